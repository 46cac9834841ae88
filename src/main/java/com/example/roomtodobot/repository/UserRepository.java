package com.example.roomtodobot.repository;

import com.example.roomtodobot.model.User;
import org.springframework.data.repository.CrudRepository;

public interface UserRepository extends CrudRepository<User, Long> {
}
