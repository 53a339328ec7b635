package com.gt.flashstudy.security;

import com.gt.flashstudy.model.Learner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Component;

@Component
public class LearnerDetailsService implements UserDetailsService {

    private final LearnerDao learnerDao;

    @Autowired
    public LearnerDetailsService(LearnerDao learnerDao) {
        this.learnerDao = learnerDao;
    }

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        Learner learner = learnerDao.getLearner(username);
        if (learner == null) {
            throw new UsernameNotFoundException("Learner " + username + " not found");
        }

        return learner;
    }
}
