/*
 * どこで: Matching API
 * 何を: 質問カタログの参照と項目の追加/引退エンドポイントを提供する
 * なぜ: カタログ変更を catalog_version の更新と一体で行う入口を 1 つにするため
 */
package com.ryvin.matching.api;

import com.ryvin.matching.api.request.RegisterFieldRequest;
import com.ryvin.matching.api.response.CatalogResponse;
import com.ryvin.matching.api.response.QuestionnaireFieldResponse;
import com.ryvin.matching.service.CatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/questionnaire")
@RequiredArgsConstructor
public class QuestionnaireController {

  private final CatalogService catalogService;

  @GetMapping("/catalog")
  public CatalogResponse getCatalog(
      @RequestParam(value = "include_retired", defaultValue = "false") boolean includeRetired) {
    return CatalogResponse.from(catalogService.currentCatalog(), includeRetired);
  }

  @PostMapping("/fields")
  public ResponseEntity<QuestionnaireFieldResponse> registerField(
      @Valid @RequestBody RegisterFieldRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(QuestionnaireFieldResponse.from(catalogService.registerField(request.toDraft())));
  }

  @DeleteMapping("/fields/{fieldId}")
  public QuestionnaireFieldResponse retireField(@PathVariable("fieldId") String fieldId) {
    return QuestionnaireFieldResponse.from(catalogService.retireField(fieldId));
  }
}
