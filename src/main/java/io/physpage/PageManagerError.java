package io.physpage;

public class PageManagerError extends Error {
    private final String code;

    public PageManagerError(String code, String message) {
        super(code + ": " + message);
        this.code = code;
    }

    public String getCode() {
        return this.code;
    }
}
