package io.rulegate.server.core;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    HEAD
}
