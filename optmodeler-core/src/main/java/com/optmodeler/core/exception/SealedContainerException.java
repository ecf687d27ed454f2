package com.optmodeler.core.exception;

/**
 * Thrown on any structural mutation of a container after it has been rendered for submission.
 */
public class SealedContainerException extends ModelingException {

    public SealedContainerException(String containerName) {
        super("Container '" + containerName + "' has been rendered and is sealed against modification");
    }
}
