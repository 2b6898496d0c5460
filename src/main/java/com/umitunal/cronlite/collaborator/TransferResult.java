package com.umitunal.cronlite.collaborator;

public class TransferResult {
    private final boolean ok;
    private final String error;

    private TransferResult(boolean ok, String error) {
        this.ok = ok;
        this.error = error;
    }

    public static TransferResult ok() {
        return new TransferResult(true, null);
    }

    public static TransferResult error(String error) {
        return new TransferResult(false, error);
    }

    public boolean isOk() { return ok; }
    public String getError() { return error; }
}
