package com.flamingo.ai.contextengine.service.response;

/** A generated reply and how it was produced. */
public record ResponseResult(String response, ResponseMetadata metadata) {}
