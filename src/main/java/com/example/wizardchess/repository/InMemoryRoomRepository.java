package com.example.wizardchess.repository;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryRoomRepository implements RoomRepository {

    private final Map<String, Room> roomStore = new ConcurrentHashMap<>();

    @Override
    public Optional<Room> findByKey(String key) {
        return Optional.ofNullable(roomStore.get(key));
    }

    @Override
    public Room save(Room room) {
        roomStore.put(room.getKey(), room);
        return room;
    }

    @Override
    public void delete(String key) {
        roomStore.remove(key);
    }
}
