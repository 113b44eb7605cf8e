package com.codeheadsystems.provision.server.model;

import com.codeheadsystems.provision.crypto.exchange.SealedPayload;

public record RefreshResult(SealedPayload sealedPayload,
                            int credentialCount,
                            String orchestratorPublicKey,
                            String orchestratorKeyId) {
}
