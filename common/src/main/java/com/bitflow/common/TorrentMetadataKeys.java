package com.bitflow.common;

@SuppressWarnings("WeakerAccess")
public final class TorrentMetadataKeys {

  public final static String MD5_SUM = "md5sum";
  public final static String FILE_LENGTH = "length";
  public final static String FILES = "files";
  public final static String FILE_PATH = "path";
  public final static String COMMENT = "comment";
  public final static String CREATED_BY = "created by";
  public final static String ENCODING = "encoding";
  public final static String ANNOUNCE = "announce";
  public final static String PIECE_LENGTH = "piece length";
  public final static String PIECES = "pieces";
  public final static String CREATION_DATE_SEC = "creation date";
  public final static String PRIVATE = "private";
  public final static String NAME = "name";
  public final static String INFO_TABLE = "info";
  public final static String ANNOUNCE_LIST = "announce-list";
  public final static String URL_LIST = "url-list";

  private TorrentMetadataKeys() {
  }
}
