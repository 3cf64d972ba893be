/*
 * Where: crafting domain model
 * What: Caller-supplied fields for creating a craft request
 * Why: The chat front end hands over raw selections; validation happens in the service
 */
package com.guildcraft.crafting.model;

import java.util.Map;

public record NewCraftRequest(
    String requesterId,
    String characterName,
    String profession,
    String gearSlot,
    String itemId,
    String itemLabel,
    Integer quantityRequested,
    Map<String, Integer> materialsRequired,
    Map<String, Integer> materialsProvidedByRequester,
    boolean requesterProvidesMaterials) {}
