package com.feedrelay.tais.stream;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Facility → client id → subscribed client.
 *
 * <p>Membership is independent of track state: a facility may have clients and no tracks.
 */
@Component
public class ClientRegistry {
  private final Map<String, Map<String, RelayClient>> clientsByFacility = new ConcurrentHashMap<>();

  /**
   * Registers a client under a facility.
   *
   * @return freshly generated opaque client id
   */
  public String register(String facility, RelayClient client) {
    String clientId = UUID.randomUUID().toString().replace("-", "");
    clientsByFacility.compute(facility, (key, clients) -> {
      Map<String, RelayClient> bucket = clients != null ? clients : new ConcurrentHashMap<>();
      bucket.put(clientId, client);
      return bucket;
    });
    return clientId;
  }

  /**
   * Removes a client; drops the facility bucket once it is empty.
   *
   * @return {@code true} when the client was registered
   */
  public boolean unregister(String facility, String clientId) {
    boolean[] removed = new boolean[1];
    clientsByFacility.computeIfPresent(facility, (key, clients) -> {
      removed[0] = clients.remove(clientId) != null;
      return clients.isEmpty() ? null : clients;
    });
    return removed[0];
  }

  public List<RelayClient> clients(String facility) {
    Map<String, RelayClient> clients = clientsByFacility.get(facility);
    return clients == null ? List.of() : List.copyOf(clients.values());
  }

  public boolean hasClients(String facility) {
    Map<String, RelayClient> clients = clientsByFacility.get(facility);
    return clients != null && !clients.isEmpty();
  }

  public int clientCount() {
    return clientsByFacility.values().stream().mapToInt(Map::size).sum();
  }
}
