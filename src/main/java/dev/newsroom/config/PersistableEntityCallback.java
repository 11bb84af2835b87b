package dev.newsroom.config;

import dev.newsroom.entity.NewRecordAware;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.OutboundRow;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.r2dbc.mapping.event.AfterSaveCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Articles, tags and media files carry UUIDs assigned before the first save, so Spring Data
 * cannot tell an insert from an update by the ID alone. A row that was just loaded or just
 * inserted is no longer new: the create flow saves the skeleton article and later updates that
 * same row.
 */
@Component
@Slf4j
public class PersistableEntityCallback
        implements AfterConvertCallback<NewRecordAware>, AfterSaveCallback<NewRecordAware> {

    @Override
    public Publisher<NewRecordAware> onAfterConvert(NewRecordAware entity, SqlIdentifier table) {
        entity.setNewRecord(false);
        return Mono.just(entity);
    }

    @Override
    public Publisher<NewRecordAware> onAfterSave(NewRecordAware entity, OutboundRow outboundRow, SqlIdentifier table) {
        if (entity.isNew()) {
            log.trace("Row inserted into {}", table);
            entity.setNewRecord(false);
        }
        return Mono.just(entity);
    }
}
