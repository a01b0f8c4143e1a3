/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.marketing.metricalerts.notifier;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NotifierUtils {

  private static final Logger LOG = LoggerFactory.getLogger(NotifierUtils.class);
  private static final int TIMEOUT_MS = (int) TimeUnit.SECONDS.toMillis(30);

  private NotifierUtils() { }

  /**
   * Send POST message to a specific URL (application/json, UTF-8)
   *
   * @param message The message that will be posted
   * @param postUrl The post URL
   * @param authorisationKey Optional API key that would be needed to authenticate to the API (put <code>null</code> if not used)
   * @return The response status code.
   * @throws IOException In case of issue with the API.
   */
  public static int sendMessage(String message, String postUrl, String authorisationKey) throws IOException {
    RequestConfig requestConfig = RequestConfig.custom()
                                               .setConnectTimeout(TIMEOUT_MS)
                                               .setConnectionRequestTimeout(TIMEOUT_MS)
                                               .setSocketTimeout(TIMEOUT_MS)
                                               .build();
    try (CloseableHttpClient client = HttpClients.custom().setDefaultRequestConfig(requestConfig).build()) {
      HttpPost httpPost = new HttpPost(postUrl);
      httpPost.setEntity(new StringEntity(message, ContentType.APPLICATION_JSON));
      if (authorisationKey != null) {
        httpPost.setHeader("Authorization", "Key " + authorisationKey);
      }
      httpPost.setHeader("Accept", "application/json");
      LOG.debug("Sending alert to: {}\nBody:\n{}", httpPost, message);
      try (CloseableHttpResponse httpResponse = client.execute(httpPost)) {
        int statusCode = httpResponse.getStatusLine().getStatusCode();
        EntityUtils.consumeQuietly(httpResponse.getEntity());
        LOG.debug("Response status: {}", statusCode);
        return statusCode;
      }
    }
  }

  /**
   * @param statusCode HTTP response status code.
   * @return {@code true} if the status code reports success.
   */
  public static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }
}
