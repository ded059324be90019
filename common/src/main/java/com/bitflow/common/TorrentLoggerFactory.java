package com.bitflow.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TorrentLoggerFactory {

  private TorrentLoggerFactory() {
  }

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz.getName());
  }
}
