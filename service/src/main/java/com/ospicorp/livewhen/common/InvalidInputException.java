package com.ospicorp.livewhen.common;

public class InvalidInputException extends RuntimeException {
  public static final int BLANK_STREAMER_ID = 1001;
  public static final int DAY_OF_WEEK_OUT_OF_RANGE = 1002;
  public static final int BLANK_USER_ID = 1003;
  public static final int INVALID_PROGRAMME = 1004;
  public static final int INVALID_WEEK = 1005;
  public static final int MISSING_TIMESTAMP = 1006;
  public static final int INVALID_PLATFORM = 1007;

  private static final String ERROR_DOCS_BASE = "https://docs.livewhen.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InvalidInputException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = ERROR_DOCS_BASE + errorCode;
  }

  public static InvalidInputException blankStreamerId() {
    return new InvalidInputException("streamer ID cannot be empty", BLANK_STREAMER_ID);
  }

  public static InvalidInputException blankUserId() {
    return new InvalidInputException("user ID cannot be empty", BLANK_USER_ID);
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
