/*
 * Where: crafting service layer
 * What: Periodically drops expired composition sessions
 * Why: Abandoned forms would otherwise sit in memory until their key is read again
 */
package com.guildcraft.crafting.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crafting.session.sweep-enabled", havingValue = "true")
public class CompositionSessionSweepWorker {

  private final CompositionSessionStore sessionStore;

  @Scheduled(fixedDelayString = "${crafting.session.sweep-interval}")
  public void run() {
    sessionStore.sweepExpired();
  }
}
