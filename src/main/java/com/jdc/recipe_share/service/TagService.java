package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.tag.TagDto;
import com.jdc.recipe_share.domain.repository.TagRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.TagMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TagService {

    private final TagRepository tagRepository;

    public List<TagDto> findAll() {
        return tagRepository.findAllByOrderByIdAsc().stream()
                .map(TagMapper::toDto)
                .toList();
    }

    public TagDto findById(Long id) {
        return tagRepository.findById(id)
                .map(TagMapper::toDto)
                .orElseThrow(() -> new CustomException(ErrorCode.TAG_NOT_FOUND));
    }
}
