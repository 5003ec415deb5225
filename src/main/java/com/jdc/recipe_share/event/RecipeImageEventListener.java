package com.jdc.recipe_share.event;

import com.jdc.recipe_share.service.RecipeImageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
public class RecipeImageEventListener {

    private final RecipeImageService recipeImageService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onImageDiscarded(RecipeImageDiscardedEvent event) {
        log.info("사용하지 않는 레시피 이미지 삭제: {}", event.getImage());
        recipeImageService.delete(event.getImage());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_ROLLBACK)
    public void onImageStoredThenRolledBack(RecipeImageStoredEvent event) {
        log.warn("트랜잭션 롤백으로 저장한 레시피 이미지 삭제: {}", event.getImage());
        recipeImageService.delete(event.getImage());
    }
}
