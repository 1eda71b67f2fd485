package com.shardchat.shard;

import com.shardchat.shard.config.ShardProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ShardProperties.class)
public class ShardNodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShardNodeApplication.class, args);
    }
}
