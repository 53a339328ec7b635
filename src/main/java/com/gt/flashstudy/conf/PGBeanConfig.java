package com.gt.flashstudy.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.flashstudy.achievement.AchievementDao;
import com.gt.flashstudy.achievement.impl.AchievementDaoPG;
import com.gt.flashstudy.deck.DeckCardDao;
import com.gt.flashstudy.deck.impl.DeckCardDaoPG;
import com.gt.flashstudy.progression.DailyProgressDao;
import com.gt.flashstudy.progression.ProgressionDao;
import com.gt.flashstudy.progression.impl.DailyProgressDaoPG;
import com.gt.flashstudy.progression.impl.ProgressionDaoPG;
import com.gt.flashstudy.scheduler.CardProgressDao;
import com.gt.flashstudy.scheduler.impl.CardProgressDaoPG;
import com.gt.flashstudy.studySession.StudySessionDao;
import com.gt.flashstudy.studySession.impl.StudySessionDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${flashstudy.datasource.postgres.url}") String url,
                                    @Value("${flashstudy.datasource.postgres.username}") String username,
                                    @Value("${flashstudy.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager getTransactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate getTransactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public DeckCardDao getDeckCardDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new DeckCardDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public CardProgressDao getCardProgressDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new CardProgressDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public StudySessionDao getStudySessionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new StudySessionDaoPG(namedParameterJdbcTemplate, objectMapper);
    }

    @Bean
    public ProgressionDao getProgressionDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ProgressionDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public DailyProgressDao getDailyProgressDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new DailyProgressDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public AchievementDao getAchievementDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new AchievementDaoPG(namedParameterJdbcTemplate);
    }
}
