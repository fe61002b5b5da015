/**
 * Exception roots. Fatal bootstrap failures extend {@link com.folio.errors.BootstrapException};
 * recoverable problems (invalid hooks or routes) are logged and never thrown.
 */
package com.folio.errors;
