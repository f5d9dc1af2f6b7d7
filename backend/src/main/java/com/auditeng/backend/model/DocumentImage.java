package com.auditeng.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One page or picture submitted with a report, as URL, data URL or raw base64.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentImage {
    private ImageType type;
    private String data;
    private Integer pageNumber;
}
