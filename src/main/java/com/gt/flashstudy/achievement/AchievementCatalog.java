package com.gt.flashstudy.achievement;

import com.gt.flashstudy.conf.CachingConfig;
import com.gt.flashstudy.model.Achievement;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AchievementCatalog {

    private final AchievementDao achievementDao;

    @Autowired
    public AchievementCatalog(AchievementDao achievementDao) {
        this.achievementDao = achievementDao;
    }

    @Cacheable(CachingConfig.ACHIEVEMENTS)
    public List<Achievement> getAllAchievements() {
        return achievementDao.loadAchievements();
    }
}
