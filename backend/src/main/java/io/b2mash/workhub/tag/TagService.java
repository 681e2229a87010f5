package io.b2mash.workhub.tag;

import io.b2mash.workhub.exception.ResourceConflictException;
import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.tag.dto.CreateTagRequest;
import io.b2mash.workhub.tag.dto.TagResponse;
import io.b2mash.workhub.tag.dto.UpdateTagRequest;
import io.b2mash.workhub.workspace.WorkspaceAccessService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TagService {

  private static final Logger log = LoggerFactory.getLogger(TagService.class);

  private final TagRepository tagRepository;
  private final WorkspaceAccessService workspaceAccessService;

  public TagService(TagRepository tagRepository, WorkspaceAccessService workspaceAccessService) {
    this.tagRepository = tagRepository;
    this.workspaceAccessService = workspaceAccessService;
  }

  @Transactional(readOnly = true)
  public List<TagResponse> listTags(Long workspaceId, Principal principal) {
    workspaceAccessService.requireMember(workspaceId, principal);
    return tagRepository.findByWorkspaceIdOrderByName(workspaceId).stream()
        .map(TagResponse::from)
        .toList();
  }

  /** Tag names are unique per workspace; a duplicate is a conflict. */
  @Transactional
  public TagResponse create(CreateTagRequest request, Principal principal) {
    workspaceAccessService.requireMember(request.workspaceId(), principal);
    String name = request.name().trim();
    if (tagRepository.existsByWorkspaceIdAndName(request.workspaceId(), name)) {
      throw duplicateName(name, request.workspaceId());
    }

    Tag tag;
    try {
      tag =
          tagRepository.save(
              new Tag(request.workspaceId(), name, request.color(), principal.accountId()));
    } catch (DataIntegrityViolationException ex) {
      // Concurrent create with the same name won the unique index
      throw duplicateName(name, request.workspaceId());
    }

    log.info(
        "Created tag: id={}, name={}, workspace={}", tag.getId(), tag.getName(), tag.getWorkspaceId());
    return TagResponse.from(tag);
  }

  @Transactional
  public TagResponse update(Long id, UpdateTagRequest request, Principal principal) {
    var tag = requireTag(id, principal);

    String name = request.name() != null ? request.name().trim() : tag.getName();
    if (!name.equals(tag.getName())
        && tagRepository.existsByWorkspaceIdAndNameAndIdNot(tag.getWorkspaceId(), name, id)) {
      throw duplicateName(name, tag.getWorkspaceId());
    }
    tag.updateMetadata(name, request.color() != null ? request.color() : tag.getColor());
    try {
      tagRepository.saveAndFlush(tag);
    } catch (DataIntegrityViolationException ex) {
      throw duplicateName(name, tag.getWorkspaceId());
    }

    log.info("Updated tag: id={}, name={}", tag.getId(), tag.getName());
    return TagResponse.from(tag);
  }

  /** Deletes the tag; links to tasks go with it. */
  @Transactional
  public void delete(Long id, Principal principal) {
    var tag = requireTag(id, principal);
    tagRepository.delete(tag);
    log.info("Deleted tag: id={}, workspace={}", tag.getId(), tag.getWorkspaceId());
  }

  private Tag requireTag(Long id, Principal principal) {
    var tag =
        tagRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Tag", id));
    workspaceAccessService.requireMember(tag.getWorkspaceId(), principal);
    return tag;
  }

  private static ResourceConflictException duplicateName(String name, Long workspaceId) {
    return new ResourceConflictException(
        "Duplicate tag", "A tag named '" + name + "' already exists in workspace " + workspaceId);
  }
}
