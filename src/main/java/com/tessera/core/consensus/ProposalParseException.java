package com.tessera.core.consensus;

/**
 * A collaborator reply that could not be read as a proposal.
 */
public class ProposalParseException extends RuntimeException {

    private final String proposerId;

    public ProposalParseException(String proposerId, String reply) {
        super("Unreadable reply from " + proposerId + ": " + snippet(reply));
        this.proposerId = proposerId;
    }

    public String proposerId() {
        return proposerId;
    }

    private static String snippet(String reply) {
        if (reply == null) {
            return "<null>";
        }
        String flat = reply.replace('\n', ' ').trim();
        return flat.length() <= 120 ? flat : flat.substring(0, 120) + "...";
    }
}
