package com.guildcraft.crafting.model;

public record ProfessionStatusCount(String profession, RequestStatus status, long count) {}
