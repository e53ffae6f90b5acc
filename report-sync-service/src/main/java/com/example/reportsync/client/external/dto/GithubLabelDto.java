package com.example.reportsync.client.external.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GithubLabelDto(String name, String color, String description) {}
