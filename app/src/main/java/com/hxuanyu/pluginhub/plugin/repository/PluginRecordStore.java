package com.hxuanyu.pluginhub.plugin.repository;

import com.hxuanyu.pluginhub.plugin.model.DuplicatePluginException;
import com.hxuanyu.pluginhub.plugin.model.PluginFilter;
import com.hxuanyu.pluginhub.plugin.model.PluginNotFoundException;
import com.hxuanyu.pluginhub.plugin.model.PluginRecord;
import com.hxuanyu.pluginhub.plugin.model.PluginRecordValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Example;
import org.springframework.data.domain.ExampleMatcher;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 插件记录存储
 * 在 {@link PluginRecordRepository} 之上提供按条件查询、局部更新等操作
 */
@Service
@Slf4j
public class PluginRecordStore {

    private static final ExampleMatcher MATCHER = ExampleMatcher.matching()
            .withIgnorePaths("id", "options", "createdAt", "updatedAt");

    private final PluginRecordRepository repository;

    public PluginRecordStore(PluginRecordRepository repository) {
        this.repository = repository;
    }

    /**
     * 列出某个应用的插件记录，按创建顺序返回
     */
    public List<PluginRecord> list(String appName) {
        return list(appName, null);
    }

    public List<PluginRecord> list(String appName, PluginFilter filter) {
        PluginFilter effective = (filter == null ? PluginFilter.builder().build() : filter.toBuilder().build());
        effective.setAppName(appName);
        return findAll(effective);
    }

    public Optional<PluginRecord> findOne(PluginFilter filter) {
        return findAll(filter).stream().findFirst();
    }

    /**
     * 查询单条记录，不存在时抛出 {@link PluginNotFoundException}
     */
    public PluginRecord getOne(PluginFilter filter) {
        return findOne(filter).orElseThrow(() ->
                new PluginNotFoundException("plugin [" + filter.getName() + "] not exists"));
    }

    @Transactional
    public PluginRecord create(PluginRecord record) {
        if (repository.existsByNameAndAppName(record.getName(), record.getAppName())) {
            throw new DuplicatePluginException("plugin [" + record.getName() + "] already exists");
        }
        try {
            PluginRecord saved = repository.saveAndFlush(record);
            log.debug("Created plugin record: {} (app={})", saved.getName(), saved.getAppName());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 并发写入时由唯一约束兜底
            throw new DuplicatePluginException("plugin [" + record.getName() + "] already exists");
        }
    }

    /**
     * 更新所有匹配记录，返回第一条；没有匹配记录时返回 empty
     */
    @Transactional
    public Optional<PluginRecord> update(PluginFilter filter, PluginRecordValues values) {
        List<PluginRecord> matched = findAll(filter);
        if (matched.isEmpty()) {
            log.debug("No plugin record matched for update: {}", filter);
            return Optional.empty();
        }
        for (PluginRecord record : matched) {
            values.applyTo(record);
        }
        List<PluginRecord> saved = repository.saveAllAndFlush(matched);
        return Optional.of(saved.get(0));
    }

    @Transactional
    public void destroy(PluginFilter filter) {
        List<PluginRecord> matched = findAll(filter);
        if (!matched.isEmpty()) {
            repository.deleteAllInBatch(matched);
            log.debug("Destroyed {} plugin record(s) for {}", matched.size(), filter);
        }
    }

    private List<PluginRecord> findAll(PluginFilter filter) {
        PluginFilter effective = filter == null ? PluginFilter.builder().build() : filter;
        return repository.findAll(Example.of(effective.toProbe(), MATCHER), Sort.by(Sort.Direction.ASC, "id"));
    }
}
