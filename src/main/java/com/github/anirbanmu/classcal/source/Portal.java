package com.github.anirbanmu.classcal.source;

import java.io.IOException;

@FunctionalInterface
public interface Portal {
    /**
     * @throws AuthenticationException if the credentials are rejected
     */
    PortalSession login(Credentials credentials) throws IOException, InterruptedException;
}
