package com.example.handoff.persistence;

import com.example.handoff.domain.MessageType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, Long> {

    Optional<MessageEntity> findByIdAndConversationId(Long id, String conversationId);

    List<MessageEntity> findByConversationIdOrderByCreatedAtAscIdAsc(String conversationId);

    List<MessageEntity> findByConversationIdAndIdGreaterThanOrderByCreatedAtAscIdAsc(
            String conversationId, Long cursor);

    List<MessageEntity> findByConversationIdAndTypeOrderByCreatedAtDescIdDesc(
            String conversationId, MessageType type);

    Optional<MessageEntity> findFirstByConversationIdAndTypeNotOrderByCreatedAtDescIdDesc(
            String conversationId, MessageType excluded);

    @Query(
            "select new com.example.handoff.persistence.MessageCount(m.conversationId, count(m)) "
                    + "from MessageEntity m "
                    + "where m.conversationId in :conversationIds and m.type <> :excluded "
                    + "group by m.conversationId")
    List<MessageCount> countByConversation(
            @Param("conversationIds") Collection<String> conversationIds,
            @Param("excluded") MessageType excluded);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from MessageEntity m where m.conversationId = :conversationId and m.type = :type")
    int deleteByConversationIdAndType(
            @Param("conversationId") String conversationId, @Param("type") MessageType type);
}
