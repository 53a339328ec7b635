package com.gt.flashstudy.model;

// Enums exchanged with clients and stored in the database by their lowercase code
public interface WireCoded {

    String getCode();
}
