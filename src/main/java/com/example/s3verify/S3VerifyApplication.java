package com.example.s3verify;

import picocli.CommandLine;

public class S3VerifyApplication {
  public static void main(String[] args) {
    System.exit(new CommandLine(new S3VerifyCommand()).execute(args));
  }
}
