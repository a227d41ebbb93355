package com.shopnest.authservice.serviceImpl;

import com.shopnest.authservice.dto.UserPage;
import com.shopnest.authservice.dto.UserResponse;
import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;
import com.shopnest.authservice.exception.RequestExceptions;
import com.shopnest.authservice.exception.UserExceptions;
import com.shopnest.authservice.repository.UserRepository;
import com.shopnest.authservice.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    static final int MAX_LIMIT = 100;

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public UserResponse getProfile(UUID userId) {
        return UserResponse.from(load(userId));
    }

    @Override
    @Transactional
    public UserResponse updateProfile(UUID userId, String firstName, String lastName) {
        User user = load(userId);
        user.updateName(firstName, lastName);
        User saved = userRepository.save(user);
        log.info("Profile updated for user id={}", userId);
        return UserResponse.from(saved);
    }

    @Override
    @Transactional
    public void deactivateOwnAccount(UUID userId) {
        User user = load(userId);
        user.deactivate();
        userRepository.save(user);
        log.info("User id={} deactivated their account", userId);
    }

    @Override
    @Transactional(readOnly = true)
    public UserPage listUsers(int page, int limit, UserRole role, Boolean isActive) {
        if (page < 1) {
            throw new RequestExceptions.InvalidParameter("page must be >= 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new RequestExceptions.InvalidParameter("limit must be between 1 and " + MAX_LIMIT);
        }
        PageRequest pageable = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<User> result = userRepository.search(role, isActive, pageable);

        return new UserPage(
                result.getContent().stream().map(UserResponse::from).toList(),
                new UserPage.Pagination(page, limit, result.getTotalElements(), result.getTotalPages()));
    }

    @Override
    @Transactional(readOnly = true)
    public UserResponse getUser(UUID id) {
        return UserResponse.from(load(id));
    }

    @Override
    @Transactional
    public UserResponse updateStatus(UUID id, boolean isActive) {
        User user = load(id);
        user.setActive(isActive);
        User saved = userRepository.save(user);
        log.info("User id={} status set to active={}", id, isActive);
        return UserResponse.from(saved);
    }

    @Override
    @Transactional
    public void deleteUser(UUID actorId, UUID id) {
        if (id.equals(actorId)) {
            throw new UserExceptions.CannotDeleteSelf();
        }
        User user = load(id);
        userRepository.delete(user);
        log.info("User id={} deleted by admin id={}", id, actorId);
    }

    private User load(UUID id) {
        return userRepository.findById(id).orElseThrow(UserExceptions.UserNotFound::new);
    }
}
