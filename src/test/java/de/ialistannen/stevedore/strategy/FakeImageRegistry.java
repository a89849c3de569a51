package de.ialistannen.stevedore.strategy;

import de.ialistannen.stevedore.registry.DigestFetchException;
import de.ialistannen.stevedore.registry.ImageRegistry;
import de.ialistannen.stevedore.registry.ImageRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An in-memory registry with a single repository.
 */
class FakeImageRegistry implements ImageRegistry {

  private final Map<String, String> digests = new LinkedHashMap<>();
  private final List<String> digestRequests = new ArrayList<>();

  FakeImageRegistry tag(String tag, String digest) {
    digests.put(tag, digest);
    return this;
  }

  List<String> digestRequests() {
    return digestRequests;
  }

  @Override
  public List<String> listTags(ImageRepository repository) {
    return new ArrayList<>(digests.keySet());
  }

  @Override
  public String getDigest(ImageRepository repository, String tag) {
    digestRequests.add(tag);
    String digest = digests.get(tag);
    if (digest == null) {
      throw new DigestFetchException(repository.imageUrl(tag), 404);
    }
    return digest;
  }
}
