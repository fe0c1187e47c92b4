package com.skillswap.common.encryption.model;

public enum ComplianceRequirement {
    GDPR,
    HIPAA,
    PCI_DSS,
    SOX,
    FIPS_140_2,
    COMMON_CRITERIA,
    ISO_27001
}
