package com.givehub.backend.modules.organizer.domain;

public enum OrganizationType {
    NONPROFIT,
    CHARITY,
    INDIVIDUAL,
    BUSINESS,
    OTHER
}
