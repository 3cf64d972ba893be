/*
 * Where: crafting configuration binding
 * What: Tunables for request creation and listing
 * Why: The double-submit window depends on how fast the chat client re-sends, so ops can adjust it
 */
package com.guildcraft.crafting.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crafting.request")
public record CraftingRequestProperties(Duration duplicateWindow, int defaultListLimit) {

  private static final Duration DEFAULT_DUPLICATE_WINDOW = Duration.ofSeconds(5);
  private static final int DEFAULT_LIST_LIMIT = 10;

  /** A zero or negative {@code duplicateWindow} turns the double-submit check off. */
  public CraftingRequestProperties {
    if (duplicateWindow == null) {
      duplicateWindow = DEFAULT_DUPLICATE_WINDOW;
    }
    if (defaultListLimit <= 0) {
      defaultListLimit = DEFAULT_LIST_LIMIT;
    }
  }
}
