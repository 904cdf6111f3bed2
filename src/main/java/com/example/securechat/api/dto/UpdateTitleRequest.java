package com.example.securechat.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record UpdateTitleRequest(@JsonProperty("title") @NotBlank String title) {
}
