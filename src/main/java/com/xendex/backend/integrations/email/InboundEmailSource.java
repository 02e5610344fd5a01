package com.xendex.backend.integrations.email;

import java.util.List;

/**
 * Lists emails received by the sending domain, newest first.
 */
public interface InboundEmailSource {

    boolean isConfigured();

    /**
     * @throws com.xendex.backend.exceptions.CollaboratorException when the provider cannot be reached
     */
    List<InboundEmail> fetchReceived();
}
