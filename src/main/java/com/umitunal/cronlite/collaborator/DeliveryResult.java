package com.umitunal.cronlite.collaborator;

public class DeliveryResult {
    private final boolean ok;
    private final int statusCode;
    private final String error;

    private DeliveryResult(boolean ok, int statusCode, String error) {
        this.ok = ok;
        this.statusCode = statusCode;
        this.error = error;
    }

    public static DeliveryResult ok(int statusCode) {
        return new DeliveryResult(true, statusCode, null);
    }

    public static DeliveryResult error(int statusCode, String error) {
        return new DeliveryResult(false, statusCode, error);
    }

    /**
     * Failure before any response arrived.
     */
    public static DeliveryResult error(String error) {
        return new DeliveryResult(false, -1, error);
    }

    public boolean isOk() { return ok; }
    public int getStatusCode() { return statusCode; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return ok ? "delivered (" + statusCode + ")" : "failed (" + statusCode + "): " + error;
    }
}
