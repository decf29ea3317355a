package com.williamcallahan.media_recommendation_engine.exception;

/**
 * The only error a catalog request surfaces to its caller: the user configuration is unusable
 */
public class InvalidUserConfigException extends RuntimeException {

    public InvalidUserConfigException(String message) {
        super(message);
    }
}
