package com.codeheadsystems.keyring.sample;

import com.codeheadsystems.keyring.exceptions.PlatformFailureException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads and writes snapshots of a sample store's credentials as pretty-printed JSON.
 * <p>
 * Buckets are written in service/user order and credentials in uuid order so that two
 * snapshots of the same content are byte-identical. Empty buckets are not written. There
 * is no format version: a change to this layout breaks existing backing files.
 */
public class StoreCodec {

  private final ObjectMapper mapper;

  public StoreCodec() {
    this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
  }

  public StoreCodec(final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Encodes the credential map.
   *
   * @param credentials the credentials, by id then uuid
   * @return the JSON text
   * @throws PlatformFailureException if serialization fails
   */
  public String encode(final Map<CredentialId, ? extends Map<String, CredentialValue>> credentials) {
    List<StoredBucket> buckets = new ArrayList<>();
    credentials.forEach((id, bucket) -> {
      if (!bucket.isEmpty()) {
        buckets.add(new StoredBucket(id.service(), id.user(), new TreeMap<>(bucket)));
      }
    });
    buckets.sort(Comparator.comparing(StoredBucket::service).thenComparing(StoredBucket::user));
    try {
      return mapper.writeValueAsString(new StoredCredentials(buckets));
    } catch (IOException e) {
      throw new PlatformFailureException(e);
    }
  }

  /**
   * Decodes text produced by {@link #encode}.
   *
   * @param content the JSON text
   * @return a fresh, mutable credential map
   * @throws PlatformFailureException if the content cannot be decoded or has missing fields
   */
  public ConcurrentHashMap<CredentialId, ConcurrentHashMap<String, CredentialValue>> decode(
      final String content) {
    StoredCredentials stored;
    try {
      stored = mapper.readValue(content, StoredCredentials.class);
    } catch (IOException e) {
      throw new PlatformFailureException(e);
    }
    if (stored == null) {
      throw malformed("no snapshot object");
    }
    ConcurrentHashMap<CredentialId, ConcurrentHashMap<String, CredentialValue>> result =
        new ConcurrentHashMap<>();
    if (stored.buckets() == null) {
      return result;
    }
    for (StoredBucket bucket : stored.buckets()) {
      if (bucket == null || bucket.service() == null || bucket.user() == null) {
        throw malformed("bucket without service and user");
      }
      ConcurrentHashMap<String, CredentialValue> values = result.computeIfAbsent(
          new CredentialId(bucket.service(), bucket.user()), k -> new ConcurrentHashMap<>());
      if (bucket.credentials() == null) {
        continue;
      }
      for (Map.Entry<String, CredentialValue> credential : bucket.credentials().entrySet()) {
        if (credential.getKey() == null || credential.getValue() == null) {
          throw malformed("credential without uuid or value in " + bucket.service() + "/" + bucket.user());
        }
        values.put(credential.getKey(), credential.getValue());
      }
    }
    return result;
  }

  private static PlatformFailureException malformed(final String problem) {
    return new PlatformFailureException(new IOException("Malformed credential snapshot: " + problem));
  }

  /**
   * Overwrites the file with a snapshot of the credentials.
   *
   * @param path        the backing file
   * @param credentials the credentials
   * @throws PlatformFailureException if encoding or writing fails
   */
  public void write(final Path path,
                    final Map<CredentialId, ? extends Map<String, CredentialValue>> credentials) {
    String content = encode(credentials);
    try {
      Files.writeString(path, content);
    } catch (IOException e) {
      throw new PlatformFailureException(e);
    }
  }

  /**
   * Loads a snapshot. A file that does not exist loads as an empty map.
   *
   * @param path the backing file
   * @return the credentials
   * @throws PlatformFailureException if the file exists but cannot be read or decoded
   */
  public ConcurrentHashMap<CredentialId, ConcurrentHashMap<String, CredentialValue>> read(
      final Path path) {
    if (!Files.exists(path)) {
      return new ConcurrentHashMap<>();
    }
    try {
      return decode(Files.readString(path));
    } catch (IOException e) {
      throw new PlatformFailureException(e);
    }
  }

  record StoredCredentials(@JsonProperty("buckets") List<StoredBucket> buckets) {
  }

  record StoredBucket(
      @JsonProperty("service") String service,
      @JsonProperty("user") String user,
      @JsonProperty("credentials") Map<String, CredentialValue> credentials) {
  }
}
