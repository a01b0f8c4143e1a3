/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.notifier;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An Office 365 connector MessageCard with a single section of facts and an optional link.
 */
public final class MSTeamsMessage implements Serializable {
  private static final long serialVersionUID = 1L;
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
  static final String TYPE = "@type";
  static final String CONTEXT = "@context";
  static final String MESSAGE_CARD = "MessageCard";
  static final String SCHEMA_EXTENSIONS = "http://schema.org/extensions";
  static final String OPEN_URI = "OpenUri";
  private final String _title;
  private final String _summary;
  private final String _themeColor;
  private final Map<String, String> _facts;
  private final String _actionName;
  private final String _actionUrl;

  /**
   * @param title Title of the card.
   * @param summary Summary shown in notifications.
   * @param themeColor Hex color of the card accent, without leading '#'.
   * @param facts Name-value pairs in display order.
   * @param actionName Label of the link, ignored if there is no link.
   * @param actionUrl Target of the link, {@code null} for none.
   */
  public MSTeamsMessage(String title,
                        String summary,
                        String themeColor,
                        Map<String, String> facts,
                        String actionName,
                        String actionUrl) {
    _title = title;
    _summary = summary;
    _themeColor = themeColor;
    _facts = Collections.unmodifiableMap(new LinkedHashMap<>(facts));
    _actionName = actionName;
    _actionUrl = actionUrl;
  }

  public String getTitle() {
    return _title;
  }

  public String getSummary() {
    return _summary;
  }

  public String getThemeColor() {
    return _themeColor;
  }

  public Map<String, String> getFacts() {
    return _facts;
  }

  public String getActionName() {
    return _actionName;
  }

  /**
   * @return The link of the card, or {@code null} if there is none.
   */
  public String getActionUrl() {
    return _actionUrl;
  }

  /**
   * @return The card as a JSON document.
   */
  public JsonObject toJsonObject() {
    JsonObject card = new JsonObject();
    card.addProperty(TYPE, MESSAGE_CARD);
    card.addProperty(CONTEXT, SCHEMA_EXTENSIONS);
    card.addProperty("themeColor", _themeColor);
    card.addProperty("summary", _summary);
    card.addProperty("title", _title);

    JsonArray facts = new JsonArray();
    _facts.forEach((name, value) -> {
      JsonObject fact = new JsonObject();
      fact.addProperty("name", name);
      fact.addProperty("value", value);
      facts.add(fact);
    });
    JsonObject section = new JsonObject();
    section.add("facts", facts);
    JsonArray sections = new JsonArray();
    sections.add(section);
    card.add("sections", sections);

    if (_actionUrl != null) {
      JsonObject target = new JsonObject();
      target.addProperty("os", "default");
      target.addProperty("uri", _actionUrl);
      JsonArray targets = new JsonArray();
      targets.add(target);
      JsonObject action = new JsonObject();
      action.addProperty(TYPE, OPEN_URI);
      action.addProperty("name", _actionName);
      action.add("targets", targets);
      JsonArray actions = new JsonArray();
      actions.add(action);
      card.add("potentialAction", actions);
    }
    return card;
  }

  /**
   * Parse a card produced by {@link #toString()}.
   *
   * @param json The JSON document of a card.
   * @return The parsed card.
   */
  public static MSTeamsMessage fromJson(String json) {
    JsonObject card = JsonParser.parseString(json).getAsJsonObject();
    if (!card.has(TYPE) || !MESSAGE_CARD.equals(card.get(TYPE).getAsString())) {
      throw new IllegalArgumentException("Not a MessageCard: " + json);
    }
    Map<String, String> facts = new LinkedHashMap<>();
    for (JsonElement section : card.getAsJsonArray("sections")) {
      for (JsonElement fact : section.getAsJsonObject().getAsJsonArray("facts")) {
        JsonObject nameAndValue = fact.getAsJsonObject();
        facts.put(nameAndValue.get("name").getAsString(), nameAndValue.get("value").getAsString());
      }
    }
    String actionName = null;
    String actionUrl = null;
    if (card.has("potentialAction")) {
      JsonObject action = card.getAsJsonArray("potentialAction").get(0).getAsJsonObject();
      actionName = action.get("name").getAsString();
      actionUrl = action.getAsJsonArray("targets").get(0).getAsJsonObject().get("uri").getAsString();
    }
    return new MSTeamsMessage(card.get("title").getAsString(), card.get("summary").getAsString(),
                              card.get("themeColor").getAsString(), facts, actionName, actionUrl);
  }

  @Override
  public String toString() {
    return GSON.toJson(toJsonObject());
  }
}
