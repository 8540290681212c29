package io.shotmatrix.automation;

import io.shotmatrix.runtime.CancellationToken;

import java.net.URI;

public interface SessionProvider {
    /**
     * @throws io.shotmatrix.error.ProvisioningException when no session could be created
     */
    AutomationSession open(URI serverUrl, SessionCapabilities capabilities, CancellationToken token);
}
