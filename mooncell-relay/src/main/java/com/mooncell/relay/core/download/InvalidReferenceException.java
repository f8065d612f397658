package com.mooncell.relay.core.download;

public class InvalidReferenceException extends RuntimeException {

    public InvalidReferenceException(String link, String problem) {
        super("Invalid message link '" + link + "': " + problem);
    }
}
