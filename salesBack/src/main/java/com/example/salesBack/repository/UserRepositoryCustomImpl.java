package com.example.salesBack.repository;

import com.example.salesBack.model.User;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.LocalDateTime;
import java.util.Optional;

public class UserRepositoryCustomImpl implements UserRepositoryCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    public UserRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<User> incrementFailedLoginAttempts(String userId) {
        Query notBlocked = new Query(Criteria.where("id").is(userId).and("blocked").is(false));
        Update update = new Update()
                .inc("failedLoginAttempts", 1)
                .set("updatedAt", LocalDateTime.now());
        return Optional.ofNullable(mongoTemplate.findAndModify(notBlocked, update, RETURN_NEW, User.class));
    }

    @Override
    public boolean block(String userId, LocalDateTime blockedAt) {
        Query notBlocked = new Query(Criteria.where("id").is(userId).and("blocked").is(false));
        Update update = new Update()
                .set("blocked", true)
                .set("blockedAt", blockedAt)
                .set("updatedAt", LocalDateTime.now());
        return mongoTemplate.updateFirst(notBlocked, update, User.class).getModifiedCount() > 0;
    }

    @Override
    public Optional<User> updateFields(String userId, Update update) {
        update.set("updatedAt", LocalDateTime.now());
        Query byId = new Query(Criteria.where("id").is(userId));
        return Optional.ofNullable(mongoTemplate.findAndModify(byId, update, RETURN_NEW, User.class));
    }
}
