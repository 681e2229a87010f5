package io.b2mash.workhub.attachment;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AttachmentRepository extends JpaRepository<Attachment, Long> {

  List<Attachment> findByTaskIdOrderByIdAsc(Long taskId);

  List<Attachment> findByCommentIdOrderByIdAsc(Long commentId);
}
