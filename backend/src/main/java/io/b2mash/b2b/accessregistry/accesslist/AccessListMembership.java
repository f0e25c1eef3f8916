package io.b2mash.b2b.accessregistry.accesslist;

import java.time.Instant;
import java.util.UUID;

public record AccessListMembership(UUID partyId, Instant since) {}
