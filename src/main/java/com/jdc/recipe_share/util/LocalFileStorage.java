package com.jdc.recipe_share.util;

import com.jdc.recipe_share.config.MediaProperties;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * app.media.root 아래에 파일을 저장하고, 공개 경로(app.media.url-prefix/...)를 돌려준다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalFileStorage {

    private final MediaProperties mediaProperties;

    public String store(String fileKey, byte[] bytes) {
        Path target = resolve(fileKey);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException e) {
            log.error("파일 저장 실패 - key: {}", fileKey, e);
            throw new CustomException(ErrorCode.IMAGE_STORE_FAILED, e);
        }
        log.info("파일 저장 완료 - key: {}, size: {}", fileKey, bytes.length);
        return publicPath(fileKey);
    }

    public void delete(String fileKey) {
        try {
            Files.deleteIfExists(resolve(fileKey));
        } catch (IOException e) {
            // 파일이 남아도 DB 정합성에는 영향 없음
            log.warn("파일 삭제 실패 - key: {}, error: {}", fileKey, e.getMessage());
        }
    }

    public String publicPath(String fileKey) {
        return mediaProperties.getUrlPrefix() + "/" + fileKey;
    }

    /**
     * 공개 경로에서 fileKey 를 꺼낸다. 이 저장소의 경로가 아니면 null.
     */
    public String toFileKey(String publicPath) {
        String prefix = mediaProperties.getUrlPrefix() + "/";
        if (publicPath == null || !publicPath.startsWith(prefix)) {
            return null;
        }
        return publicPath.substring(prefix.length());
    }

    private Path resolve(String fileKey) {
        Path root = Paths.get(mediaProperties.getRoot()).toAbsolutePath().normalize();
        Path target = root.resolve(fileKey).normalize();
        if (!target.startsWith(root)) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_IMAGE, "잘못된 파일 경로입니다.");
        }
        return target;
    }
}
