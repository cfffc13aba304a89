package com.fintech.bankrec.exception;

/**
 * Thrown when the vendor canonicalization table cannot be read.
 * These failures are transient and the lookup is retried before falling back to
 * the raw vendor name.
 */
public class VendorLookupException extends ReconciliationException {

    private final String vendorName;

    public VendorLookupException(String message, String vendorName, Throwable cause) {
        super(ReconciliationErrorType.VENDOR_LOOKUP, message, cause);
        this.vendorName = vendorName;
    }

    public String getVendorName() {
        return vendorName;
    }
}
