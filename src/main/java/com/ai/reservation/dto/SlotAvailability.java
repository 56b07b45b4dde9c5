package com.ai.reservation.dto;

public record SlotAvailability(int available, int total) {
}
