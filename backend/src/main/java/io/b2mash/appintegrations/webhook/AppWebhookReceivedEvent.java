package io.b2mash.appintegrations.webhook;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for every authenticated inbound webhook. Carries ids and the raw body only, never the
 * integration's secrets.
 */
public record AppWebhookReceivedEvent(
    UUID integrationId, String tenantId, String platformId, String payload, Instant receivedAt) {}
