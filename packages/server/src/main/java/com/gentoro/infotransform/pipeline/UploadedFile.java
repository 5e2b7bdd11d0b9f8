package com.gentoro.infotransform.pipeline;

/**
 * A file as received from the caller.
 *
 * @param mediaType declared content type; may be null
 */
public record UploadedFile(String filename, String mediaType, byte[] content) {
  public UploadedFile {
    if (filename == null || filename.isBlank()) filename = "upload";
    if (content == null) content = new byte[0];
  }
}
