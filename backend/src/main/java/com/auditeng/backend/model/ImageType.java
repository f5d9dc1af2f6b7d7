package com.auditeng.backend.model;

/**
 * Kind of page or picture taken from a scanned report.
 */
public enum ImageType {
    THERMAL,
    VISIBLE,
    CERTIFICATE,
    REPORT_PAGE
}
