package com.bitflow.cli;

import com.bitflow.TempFiles;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

@Test
public class ClientMainTest {

  private TempFiles tempFiles;
  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @BeforeMethod
  public void setUp() {
    tempFiles = new TempFiles();
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  @AfterMethod
  public void tearDown() {
    tempFiles.cleanup();
  }

  private int run(String... args) {
    return ClientMain.run(args, new PrintStream(out, true), new PrintStream(err, true));
  }

  private String err() {
    return new String(err.toByteArray(), StandardCharsets.UTF_8);
  }

  public void testHelp() {
    assertEquals(run("--help"), 0);
    assertTrue(new String(out.toByteArray(), StandardCharsets.UTF_8).startsWith("usage: bitflow"));
  }

  public void testMissingTorrentArgument() {
    assertEquals(run("-o", "/tmp"), 1);
    assertTrue(err().contains("usage: bitflow"));
  }

  public void testUnknownOption() {
    assertEquals(run("--frobnicate", "file.torrent"), 1);
  }

  public void testInvalidPort() {
    assertEquals(run("-p", "70000", "file.torrent"), 1);
    assertTrue(err().contains("Invalid port 70000"));
  }

  public void testUndecodableTorrent() throws Exception {
    File torrent = tempFiles.createTempFile("broken.torrent",
            "d8:announce".getBytes(StandardCharsets.US_ASCII));
    assertEquals(run(torrent.getAbsolutePath()), 1);
    assertTrue(err().startsWith("Invalid torrent file " + torrent.getAbsolutePath()), err());
  }

  public void testMissingInfoKey() throws Exception {
    File torrent = tempFiles.createTempFile("noinfo.torrent",
            "d8:announce20:http://t.example/anne".getBytes(StandardCharsets.US_ASCII));
    assertEquals(run(torrent.getAbsolutePath()), 1);
    assertTrue(err().contains("info"), err());
  }

  public void testUnreadableTorrent() throws Exception {
    File dir = tempFiles.createTempDir();
    assertEquals(run(new File(dir, "absent.torrent").getAbsolutePath()), 2);
  }
}
