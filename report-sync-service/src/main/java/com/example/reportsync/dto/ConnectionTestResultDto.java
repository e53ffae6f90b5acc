package com.example.reportsync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionTestResultDto(boolean success, String repoName, String error) {

    public static ConnectionTestResultDto ok(String repoName) {
        return new ConnectionTestResultDto(true, repoName, null);
    }

    public static ConnectionTestResultDto failed(String error) {
        return new ConnectionTestResultDto(false, null, error);
    }
}
