package ca.gc.cra.lazypull.infrastructure.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.lazypull.domain.registry.Keychain;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DockerConfigKeychainProviderTest {

  @TempDir Path tempDir;

  @Test
  void decodesBasicAuthEntry() throws IOException {
    DockerConfigKeychainProvider provider = provider("""
        {"auths": {"registry.example.com": {"auth": "dXNlcjpwYXNz"}}}
        """);

    assertEquals(new Keychain("user", "pass"), lookup(provider, "registry.example.com"));
  }

  @Test
  void usesExplicitUsernameAndPassword() throws IOException {
    DockerConfigKeychainProvider provider = provider("""
        {"auths": {"https://registry.example.com/v2/": {"username": "bot", "password": "pw"}}}
        """);

    assertEquals(new Keychain("bot", "pw"), lookup(provider, "registry.example.com"));
  }

  @Test
  void registryTokenBecomesTokenKeychain() throws IOException {
    DockerConfigKeychainProvider provider = provider("""
        {"auths": {"registry.example.com": {"registrytoken": "token-abc"}}}
        """);

    Keychain keychain = lookup(provider, "registry.example.com");

    assertTrue(keychain.isTokenBased());
    assertEquals("token-abc", keychain.password());
  }

  @Test
  void dockerHubAliasesMatchEachOther() throws IOException {
    DockerConfigKeychainProvider provider = provider("""
        {"auths": {"https://index.docker.io/v1/": {"auth": "aHViOnNlY3JldA=="}}}
        """);

    assertEquals(new Keychain("hub", "secret"), lookup(provider, "index.docker.io"));
    assertEquals(new Keychain("hub", "secret"), lookup(provider, "docker.io"));
  }

  @Test
  void unknownHostYieldsEmptyKeychain() throws IOException {
    DockerConfigKeychainProvider provider = provider("""
        {"auths": {"registry.example.com": {"auth": "dXNlcjpwYXNz"}}}
        """);

    assertTrue(lookup(provider, "other.example.com").isEmpty());
  }

  @Test
  void missingOrMalformedFilesNeverFail() throws IOException {
    assertTrue(lookup(new DockerConfigKeychainProvider(tempDir.resolve("missing.json")), "a.example.com").isEmpty());
    assertTrue(lookup(provider("{not json"), "registry.example.com").isEmpty());
    assertTrue(lookup(provider("{\"auths\": []}"), "registry.example.com").isEmpty());
    assertTrue(lookup(provider("""
        {"auths": {"registry.example.com": {"auth": "%%%"}}}
        """), "registry.example.com").isEmpty());
  }

  @Test
  void normalizesUrlKeys() {
    assertEquals("registry.example.com:5000",
        DockerConfigKeychainProvider.normalizeKey("HTTPS://Registry.Example.com:5000/v2/"));
  }

  private DockerConfigKeychainProvider provider(String json) throws IOException {
    Path file = Files.createTempFile(tempDir, "config", ".json");
    Files.writeString(file, json);
    return new DockerConfigKeychainProvider(file);
  }

  private static Keychain lookup(DockerConfigKeychainProvider provider, String host) {
    return provider.keychainFor(host, host + "/team/app:v1", Map.of());
  }
}
