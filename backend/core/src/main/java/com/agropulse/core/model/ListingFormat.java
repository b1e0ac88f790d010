package com.agropulse.core.model;

public enum ListingFormat {
    DATED_SECTIONS,
    RSS,
    LINKS
}
