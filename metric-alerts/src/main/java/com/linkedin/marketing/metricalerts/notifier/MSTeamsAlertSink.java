/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.notifier;

import com.linkedin.marketing.metricalerts.config.constants.AlertSinkConfig;
import com.linkedin.metricalerts.model.AnomalyKind;
import com.linkedin.metricalerts.model.AnomalyRecord;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers every alert as a MessageCard to a Microsoft Teams incoming webhook.
 *
 * Drops are rendered with {@link #DROP_EMOJI} and {@link #ATTENTION_COLOR}, all other kinds with {@link #RISE_EMOJI}
 * and {@link #WARNING_COLOR}. Alerts are skipped with a warning while no webhook is configured.
 */
public class MSTeamsAlertSink implements AlertSink {

    public static final String MSTEAMS_ALERT_SINK_WEBHOOK = "msteams.alert.sink.webhook";
    public static final String DROP_EMOJI = "🚨";
    public static final String RISE_EMOJI = "📈";
    public static final String ATTENTION_COLOR = "D13438";
    public static final String WARNING_COLOR = "FFA500";
    public static final String DASHBOARD_ACTION_NAME = "Open dashboard";
    private static final Logger LOG = LoggerFactory.getLogger(MSTeamsAlertSink.class);
    protected String _msTeamsWebhook;
    protected String _dashboardUrl;

    public MSTeamsAlertSink() {
    }

    @Override
    public void configure(Map<String, ?> config) {
        _msTeamsWebhook = emptyToNull(config.get(MSTEAMS_ALERT_SINK_WEBHOOK));
        _dashboardUrl = emptyToNull(config.get(AlertSinkConfig.ALERT_DASHBOARD_URL_CONFIG));
    }

    @Override
    public AlertDeliveryResult deliver(AnomalyRecord record) {
        if (_msTeamsWebhook == null) {
            LOG.warn("MSTeams webhook is null, can't send MSTeams alert {}", record);
            return AlertDeliveryResult.skipped("No MSTeams webhook configured.");
        }

        try {
            int statusCode = sendMSTeamsMessage(toMessage(record), _msTeamsWebhook);
            if (NotifierUtils.isSuccess(statusCode)) {
                return AlertDeliveryResult.delivered(statusCode);
            }
            LOG.warn("MSTeams rejected alert {} with status {}", record, statusCode);
            return AlertDeliveryResult.failed(statusCode, "Unexpected response status " + statusCode);
        } catch (IOException e) {
            LOG.warn("ERROR sending alert to MSTeams", e);
            return AlertDeliveryResult.failed(AlertDeliveryResult.NO_STATUS_CODE, e.getMessage());
        }
    }

    /**
     * @param record The alert to render.
     * @return The card of the given alert.
     */
    public MSTeamsMessage toMessage(AnomalyRecord record) {
        boolean drop = record.kind() == AnomalyKind.DROP;
        Map<String, String> facts = new LinkedHashMap<>();
        facts.put("Entity", record.entity());
        facts.put("Metric", record.metric());
        facts.put("Kind", record.kind().wireName());
        facts.put("Value", record.displayValue());
        facts.put("Date", record.date().toString());
        facts.put("Method", record.method().wireName());
        facts.put("Score", String.valueOf(record.score()));
        String title = String.format("%s Alert: %s", drop ? DROP_EMOJI : RISE_EMOJI, record.entity());
        String summary = String.format("Alert - %s - %s - %s", record.kind().wireName(), record.metric(),
                                       record.entity());
        return new MSTeamsMessage(title, summary, drop ? ATTENTION_COLOR : WARNING_COLOR, facts,
                                  DASHBOARD_ACTION_NAME, _dashboardUrl);
    }

    protected int sendMSTeamsMessage(MSTeamsMessage msTeamsMessage, String msTeamsWebhookUrl) throws IOException {
        return NotifierUtils.sendMessage(msTeamsMessage.toString(), msTeamsWebhookUrl, null);
    }

    private static String emptyToNull(Object value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.toString().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
