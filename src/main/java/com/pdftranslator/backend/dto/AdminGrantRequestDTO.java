package com.pdftranslator.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AdminGrantRequestDTO {

    @NotNull
    private Long ownerId;

    @NotNull
    @Min(1)
    private Integer pages;

    @Size(max = 500)
    private String note;

    @Size(max = 255)
    private String externalRef;
}
