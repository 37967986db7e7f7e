package de.bsommerfeld.nestedset.core.domain;

/**
 * One row of the tree table as held by the caller.
 *
 * <p>
 * A node instance carries the bounds it last saw, which go stale as soon as
 * any other mutation shifts them; the store re-reads them whenever the node
 * serves as a reference point. Structural changes are requested through the
 * fluent methods ({@link #appendTo}, {@link #before}, ...) and buffered as a
 * single pending {@link MutationIntent} until the next save. Requesting a
 * second change before saving replaces the first.
 *
 * <p>
 * A freshly constructed node has no id and a pending {@code ROOT} intent, so
 * saving it without further instructions appends it as the last root. Nodes
 * read from storage carry no pending intent.
 */
public class TreeNode {

    private Long id;
    private String name;
    private Long parentId;
    private int lft;
    private int rgt;
    private Long deletedAt;

    private MutationIntent pendingIntent = MutationIntent.root();
    private boolean moved;

    public TreeNode(String name) {
        this.name = name;
    }

    /** Rehydrates a stored row. The result has no pending intent. */
    public static TreeNode loaded(long id, String name, Long parentId, int lft, int rgt, Long deletedAt) {
        TreeNode node = new TreeNode(name);
        node.id = id;
        node.parentId = parentId;
        node.lft = lft;
        node.rgt = rgt;
        node.deletedAt = deletedAt;
        node.pendingIntent = null;
        return node;
    }

    /** Independent copy, including the pending intent. */
    public TreeNode copy() {
        TreeNode copy = new TreeNode(name);
        copy.id = id;
        copy.parentId = parentId;
        copy.lft = lft;
        copy.rgt = rgt;
        copy.deletedAt = deletedAt;
        copy.pendingIntent = pendingIntent;
        copy.moved = moved;
        return copy;
    }

    // -- Structural intents --

    public TreeNode makeRoot() {
        return setPendingIntent(MutationIntent.root());
    }

    public TreeNode appendTo(TreeNode parent) {
        return setPendingIntent(MutationIntent.appendTo(parent));
    }

    public TreeNode prependTo(TreeNode parent) {
        return setPendingIntent(MutationIntent.prependTo(parent));
    }

    public TreeNode before(TreeNode sibling) {
        return setPendingIntent(MutationIntent.before(sibling));
    }

    public TreeNode after(TreeNode sibling) {
        return setPendingIntent(MutationIntent.after(sibling));
    }

    public MutationIntent getPendingIntent() {
        return pendingIntent;
    }

    public TreeNode setPendingIntent(MutationIntent intent) {
        this.pendingIntent = intent;
        return this;
    }

    public boolean hasPendingIntent() {
        return pendingIntent != null;
    }

    // -- Position --

    public boolean isPersisted() {
        return id != null;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public NodeBounds bounds() {
        return new NodeBounds(lft, rgt, parentId);
    }

    /**
     * Overwrites the in-memory snapshot with bounds and parent read from
     * storage. Saving the node never writes these back.
     */
    public void applyBounds(NodeBounds bounds) {
        this.lft = bounds.lft();
        this.rgt = bounds.rgt();
        this.parentId = bounds.parentId();
    }

    public void setBounds(int lft, int rgt) {
        this.lft = lft;
        this.rgt = rgt;
    }

    /**
     * Height of the node; 2 for a node that has not been saved yet since it
     * cannot have descendants.
     */
    public int getHeight() {
        if (!isPersisted()) {
            return 2;
        }
        return rgt - lft + 1;
    }

    public int getDescendantCount() {
        return getHeight() / 2 - 1;
    }

    /** Compares the bounds held by both instances, without touching storage. */
    public boolean isDescendantOf(TreeNode other) {
        return lft > other.lft && lft < other.rgt;
    }

    /**
     * Marks this instance as no longer stored, ready to be re-created as a new
     * root by another save.
     */
    public void detach() {
        this.id = null;
        this.parentId = null;
        this.deletedAt = null;
        this.pendingIntent = MutationIntent.root();
    }

    // -- Accessors --

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Parent as last read from storage. There is no setter: reparenting is a
     * structural change, request it with {@link #appendTo} or {@link #makeRoot}
     * (or {@code NestedSetRepository.moveToParent}) so the bounds follow.
     */
    public Long getParentId() {
        return parentId;
    }

    public int getLft() {
        return lft;
    }

    public int getRgt() {
        return rgt;
    }

    public Long getDeletedAt() {
        return deletedAt;
    }

    public void setDeletedAt(Long deletedAt) {
        this.deletedAt = deletedAt;
    }

    /** Whether the last save changed this node's bounds. */
    public boolean hasMoved() {
        return moved;
    }

    public void setMoved(boolean moved) {
        this.moved = moved;
    }

    @Override
    public String toString() {
        return "TreeNode{id=" + id + ", name=" + name + ", parentId=" + parentId
                + ", lft=" + lft + ", rgt=" + rgt + "}";
    }
}
