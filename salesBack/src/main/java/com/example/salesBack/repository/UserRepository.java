package com.example.salesBack.repository;

import com.example.salesBack.model.Role;
import com.example.salesBack.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends MongoRepository<User, String>, UserRepositoryCustom {
    Optional<User> findByEmail(String email);
    boolean existsByEmail(String email);

    // Find users by role
    List<User> findByRole(Role role);
}
