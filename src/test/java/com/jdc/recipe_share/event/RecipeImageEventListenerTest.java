package com.jdc.recipe_share.event;

import com.jdc.recipe_share.config.MediaProperties;
import com.jdc.recipe_share.service.RecipeImageService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RecipeImageEventListenerTest {

    @Autowired RecipeImageService recipeImageService;
    @Autowired TransactionTemplate transactionTemplate;
    @Autowired MediaProperties mediaProperties;

    private Path fileOf(String publicPath) {
        return Paths.get(mediaProperties.getRoot())
                .resolve(publicPath.substring(mediaProperties.getUrlPrefix().length() + 1));
    }

    private String dataUri(String content) {
        return "data:image/png;base64,"
                + Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("트랜잭션이 롤백되면 그 안에서 저장한 이미지 파일도 지워진다")
    void storedImage_removedOnRollback() {
        String path = transactionTemplate.execute(status -> {
            String stored = recipeImageService.resolve(dataUri("rolled-back"));
            assertThat(fileOf(stored)).exists();
            status.setRollbackOnly();
            return stored;
        });

        assertThat(fileOf(path)).doesNotExist();
    }

    @Test
    @DisplayName("커밋되면 저장한 이미지는 남는다")
    void storedImage_keptOnCommit() {
        String path = transactionTemplate.execute(status -> recipeImageService.resolve(dataUri("committed")));

        assertThat(fileOf(path)).exists();
        recipeImageService.delete(path);
    }

    @Test
    @DisplayName("discard 한 이미지는 커밋 후에 지워지고 롤백되면 남는다")
    void discardedImage_removedOnlyAfterCommit() {
        String kept = recipeImageService.store(new MockMultipartFile("image", "a.png", "image/png", new byte[]{1}));
        String removed = recipeImageService.store(new MockMultipartFile("image", "b.png", "image/png", new byte[]{2}));

        transactionTemplate.executeWithoutResult(status -> {
            recipeImageService.discard(kept);
            status.setRollbackOnly();
        });
        assertThat(fileOf(kept)).exists();

        transactionTemplate.executeWithoutResult(status -> {
            recipeImageService.discard(removed);
            assertThat(fileOf(removed)).exists();
        });
        assertThat(fileOf(removed)).doesNotExist();

        recipeImageService.delete(kept);
    }
}
