package com.gentoro.recordbridge.http;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE;

  public boolean hasBody() {
    return this == POST || this == PUT;
  }
}
