package com.jdc.recipe_share.service;

import com.jdc.recipe_share.event.RecipeImageDiscardedEvent;
import com.jdc.recipe_share.event.RecipeImageStoredEvent;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.util.Base64ImageDecoder;
import com.jdc.recipe_share.util.Base64ImageDecoder.DecodedImage;
import com.jdc.recipe_share.util.LocalFileStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeImageService {

    private static final String RECIPE_DIR = "recipes/";

    private final LocalFileStorage fileStorage;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 요청의 image 값을 저장된 공개 경로로 바꾼다.
     * data URI 는 디코딩해서 저장하고, 이미 저장된 레시피 이미지 경로는 그대로 둔다.
     */
    public String resolve(String image) {
        if (!StringUtils.hasText(image)) {
            throw new CustomException(ErrorCode.RECIPE_IMAGE_REQUIRED);
        }
        if (Base64ImageDecoder.isDataUri(image)) {
            DecodedImage decoded = Base64ImageDecoder.decode(image);
            return storeBytes(decoded.extension(), decoded.bytes());
        }
        if (isRecipeImageKey(fileStorage.toFileKey(image))) {
            return image;
        }
        throw new CustomException(ErrorCode.INVALID_RECIPE_IMAGE);
    }

    // multipart 업로드
    public String store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new CustomException(ErrorCode.RECIPE_IMAGE_REQUIRED);
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_IMAGE, "이미지 파일만 업로드할 수 있습니다.");
        }
        String extension = Base64ImageDecoder.extensionOf(contentType.substring("image/".length()).split(";")[0].trim());
        try {
            return storeBytes(extension, file.getBytes());
        } catch (IOException e) {
            throw new CustomException(ErrorCode.IMAGE_STORE_FAILED, e);
        }
    }

    /**
     * 레시피가 더 이상 쓰지 않는 이미지를 현재 트랜잭션이 커밋된 뒤 삭제하도록 예약한다.
     */
    public void discard(String image) {
        eventPublisher.publishEvent(new RecipeImageDiscardedEvent(image));
    }

    public void delete(String image) {
        String fileKey = fileStorage.toFileKey(image);
        if (isRecipeImageKey(fileKey)) {
            fileStorage.delete(fileKey);
        }
    }

    private String storeBytes(String extension, byte[] bytes) {
        String path = fileStorage.store(newFileKey(extension), bytes);
        eventPublisher.publishEvent(new RecipeImageStoredEvent(path));
        return path;
    }

    private boolean isRecipeImageKey(String fileKey) {
        return fileKey != null && fileKey.startsWith(RECIPE_DIR) && !fileKey.contains("..");
    }

    private String newFileKey(String extension) {
        return RECIPE_DIR + UUID.randomUUID().toString().replace("-", "") + "." + extension;
    }
}
