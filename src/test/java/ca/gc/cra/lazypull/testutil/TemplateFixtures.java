package ca.gc.cra.lazypull.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Daemon configuration templates shared by tests. */
public final class TemplateFixtures {

  public static final String FUSE_REGISTRY = """
      {
        "device": {
          "backend": {
            "type": "registry",
            "config": {
              "scheme": "https",
              "skip_verify": false,
              "timeout": 5,
              "connect_timeout": 5,
              "retry_limit": 2
            }
          },
          "cache": {
            "type": "blobcache",
            "config": { "work_dir": "/var/lib/lazypull/cache" }
          }
        },
        "mode": "direct",
        "digest_validate": false,
        "iostats_files": false,
        "enable_xattr": true,
        "fs_prefetch": {
          "enable": true,
          "threads_count": 8,
          "merging_size": 1048576,
          "prefetch_all": true
        }
      }
      """;

  public static final String FUSE_LOCALFS = """
      {
        "device": {
          "backend": {
            "type": "localfs",
            "config": { "dir": "/var/lib/blobs", "readahead": true }
          },
          "cache": { "type": "" }
        },
        "mode": "direct"
      }
      """;

  public static final String FUSE_OSS = """
      {
        "device": {
          "backend": {
            "type": "oss",
            "config": {
              "endpoint": "oss.example.com",
              "access_key_id": "AKID-SECRET",
              "access_key_secret": "SK-SECRET",
              "bucket_name": "images",
              "object_prefix": "blobs/"
            }
          },
          "cache": { "type": "blobcache" }
        },
        "mode": "cached"
      }
      """;

  public static final String FUSE_UNKNOWN_BACKEND = """
      {
        "device": {
          "backend": { "type": "s3", "config": { "host": "s3.example.com" } },
          "cache": { "type": "blobcache" }
        },
        "mode": "direct"
      }
      """;

  public static final String FSCACHE_REGISTRY = """
      {
        "type": "bootstrap",
        "id": "",
        "domain_id": "domain-1",
        "config": {
          "id": "",
          "backend_type": "registry",
          "backend_config": {
            "scheme": "https",
            "auth": "dGVtcGxhdGU6c2VjcmV0"
          },
          "cache_type": "fscache",
          "cache_config": { "work_dir": "/var/lib/lazypull/cache" },
          "prefetch_config": { "enable": true, "threads_count": 4 },
          "metadata_path": ""
        },
        "fs_prefetch": { "enable": false }
      }
      """;

  private TemplateFixtures() {}

  /**
   * Writes a template into {@code dir}.
   *
   * @return template location
   */
  public static Path write(Path dir, String name, String content) throws IOException {
    Path file = dir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  /**
   * Writes {@code <root>/<host>/hosts.yaml}.
   *
   * @return hosts file location
   */
  public static Path writeMirrors(Path root, String host, String yaml) throws IOException {
    Path dir = Files.createDirectories(root.resolve(host));
    Path file = dir.resolve("hosts.yaml");
    Files.writeString(file, yaml, StandardCharsets.UTF_8);
    return file;
  }
}
