package com.jdc.recipe_share.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 업로드 이미지 저장 위치 (app.media.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.media")
public class MediaProperties {

    // 파일이 저장되는 디렉터리
    private String root = "media";

    // 응답에 노출되는 경로 접두사
    private String urlPrefix = "/media";
}
