package com.questrail.hal.api;

/**
 * Thrown when a {@link ParameterSet} lookup names a parameter or sub-tree that
 * does not exist.
 */
public final class UnknownParameterException extends RuntimeException
{
    private final String path;

    public UnknownParameterException(String setName, String path) {
        super("No parameter '" + path + "' in parameter set '" + setName + "'");
        this.path = path;
    }

    public String path() {
        return path;
    }
}
