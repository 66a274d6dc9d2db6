package com.ryvin.matching.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ryvin.matching.model.QuestionnaireCatalog;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record CatalogResponse(long catalogVersion, List<QuestionnaireFieldResponse> fields) {

  /** includeRetired が false なら有効な項目だけを返す。 */
  public static CatalogResponse from(QuestionnaireCatalog catalog, boolean includeRetired) {
    return new CatalogResponse(
        catalog.version(),
        (includeRetired ? catalog.fields() : catalog.activeFields())
            .stream().map(QuestionnaireFieldResponse::from).toList());
  }
}
