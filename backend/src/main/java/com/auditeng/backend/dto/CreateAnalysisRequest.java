package com.auditeng.backend.dto;

import com.auditeng.backend.model.DocumentImage;
import com.auditeng.backend.model.TestType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to audit one report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAnalysisRequest {

    @NotBlank
    private String companyId;

    @NotBlank
    private String userId;

    @NotNull
    private TestType testType;

    @NotBlank
    private String filename;

    @NotEmpty
    @Valid
    @Builder.Default
    private List<DocumentImage> images = new ArrayList<>();

    private String reportText;
    private String expectedTag;
    private String expectedSerial;
}
