package com.folio.routes;

import com.folio.errors.BootstrapException;

/**
 * Two distinct requests resolved to the same permalink. Carries both requests so the responsible
 * routes and slugs can be identified from the message alone.
 */
public final class DuplicatePermalinkException extends BootstrapException {

    private final String permalink;
    private final Request first;
    private final Request second;

    public DuplicatePermalinkException(String permalink, Request first, Request second) {
        super("Duplicate permalink '" + permalink + "' detected. Here are the relevant requests: "
                + first.toJson() + " and " + second.toJson());
        this.permalink = permalink;
        this.first = first;
        this.second = second;
    }

    public String getPermalink() {
        return permalink;
    }

    public Request getFirst() {
        return first;
    }

    public Request getSecond() {
        return second;
    }
}
