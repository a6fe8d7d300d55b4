package com.certchaperone.backend.modules.identity.application;

import java.util.UUID;

public record IdentityProfile(UUID id, String email, String displayName) {
}
