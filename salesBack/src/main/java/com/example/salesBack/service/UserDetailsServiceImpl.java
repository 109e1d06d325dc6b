package com.example.salesBack.service;

import com.example.salesBack.repository.UserRepository;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

@Service
public class UserDetailsServiceImpl implements UserDetailsService {

    private final UserRepository userRepository;

    public UserDetailsServiceImpl(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        // In this context, 'username' is actually the email.
        // Lock and active checks are left to the authentication provider, which runs them before the password check.
        return userRepository.findByEmail(UserService.normalizeEmail(username))
                .orElseThrow(() -> new UsernameNotFoundException("User not found with email: " + username));
    }
}
