package com.example.wizardchess.repository;

import java.util.Optional;

public interface RoomRepository {

    Optional<Room> findByKey(String key);

    Room save(Room room);

    void delete(String key);
}
