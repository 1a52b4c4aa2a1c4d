package com.hxuanyu.pluginhub.plugin.repository;

import com.hxuanyu.pluginhub.plugin.model.PluginRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PluginRecordRepository extends JpaRepository<PluginRecord, Long> {

    boolean existsByNameAndAppName(String name, String appName);
}
