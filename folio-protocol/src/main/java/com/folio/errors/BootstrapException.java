package com.folio.errors;

/**
 * Fatal condition that aborts pipeline bootstrap. No partially-ready pipeline is ever exposed
 * after one of these is thrown; the process is expected to terminate.
 */
public class BootstrapException extends FolioException {

    public BootstrapException(String message) {
        super(message);
    }

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
