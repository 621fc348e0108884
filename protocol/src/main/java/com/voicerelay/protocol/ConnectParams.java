package com.voicerelay.protocol;

import java.util.List;

/**
 * Params of the {@code connect} request sent in reply to a challenge.
 */
public record ConnectParams(int minProtocol,
                            int maxProtocol,
                            ClientIdentity client,
                            String role,
                            List<String> scopes,
                            List<String> caps,
                            Auth auth) {

    public record Auth(String token) {
    }
}
