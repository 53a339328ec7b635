package com.gt.flashstudy.model;

public record Achievement(String id,
                          String title,
                          String description,
                          String icon,
                          String tier,
                          int xpReward,
                          String conditionType,
                          int conditionValue) { }
