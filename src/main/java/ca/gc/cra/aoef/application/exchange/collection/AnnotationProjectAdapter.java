package ca.gc.cra.aoef.application.exchange.collection;

import ca.gc.cra.aoef.application.exchange.AdapterTree;
import ca.gc.cra.aoef.application.exchange.record.AnnotationProjectRecord;
import ca.gc.cra.aoef.application.exchange.record.AnnotationTaskRecord;
import ca.gc.cra.aoef.domain.AnnotationTask;
import ca.gc.cra.aoef.domain.ClipAnnotation;
import ca.gc.cra.aoef.domain.Tag;
import ca.gc.cra.aoef.domain.collection.AnnotationProject;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports and imports annotation projects. Tasks and project tags are exchanged before the clip
 * annotations, so their clips and tags take the lowest ids.
 *
 * @since 0.1.0
 */
public final class AnnotationProjectAdapter extends AnnotationSetAdapter {

  public AnnotationProjectAdapter(AdapterTree tree) {
    super(tree);
  }

  public AnnotationProjectRecord toRecord(AnnotationProject project) {
    for (AnnotationTask task : project.tasks()) {
      tree.annotationTasks().toExchange(task);
    }
    List<Integer> projectTags = tree.tags().toIds(project.projectTags());
    collectClipAnnotations(project);
    return new AnnotationProjectRecord(
        project.uuid(),
        project.createdOn(),
        tree.snapshot(),
        project.name(),
        project.description(),
        project.instructions(),
        projectTags,
        tree.annotationTasks().values());
  }

  public AnnotationProject toCollection(AnnotationProjectRecord record) {
    List<ClipAnnotation> clipAnnotations = hydrateClipAnnotations(record);
    String owner = record.kind().tag() + " " + record.uuid();
    List<AnnotationTask> tasks = new ArrayList<>(record.tasks().size());
    for (AnnotationTaskRecord task : record.tasks()) {
      tasks.add(tree.annotationTasks().toDomain(task));
    }
    List<Tag> projectTags = tree.tags().fromIds(record.projectTags(), owner);
    return new AnnotationProject(
        record.uuid(),
        clipAnnotations,
        record.createdOn(),
        record.name(),
        record.description(),
        record.instructions(),
        projectTags,
        tasks);
  }
}
