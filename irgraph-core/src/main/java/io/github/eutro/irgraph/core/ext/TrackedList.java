package io.github.eutro.irgraph.core.ext;

import java.util.*;

/**
 * A list view which is notified whenever an element enters or leaves it.
 * <p>
 * Owning lists in the IR use the hooks to attach and detach owner exts, so
 * an element's owner is always the list it is currently in.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    public TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    /**
     * Called before an element is added to the list.
     *
     * @param elt The element.
     */
    protected abstract void onAdded(E elt);

    /**
     * Called after an element has been removed from the list.
     *
     * @param elt The element.
     */
    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public boolean add(E e) {
        onAdded(e);
        return viewed.add(e);
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E set(int index, E element) {
        if (viewed.get(index) == element) return element;
        onAdded(element);
        E removed = viewed.set(index, element);
        onRemoved(removed);
        return removed;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        List<E> old = new ArrayList<>(viewed);
        viewed.clear();
        for (E e : old) {
            onRemoved(e);
        }
    }

    /**
     * Get the index of an element by identity rather than {@link Object#equals(Object)}.
     *
     * @param o The element.
     * @return The index, or -1 if it is not in this list.
     */
    public int identityIndexOf(Object o) {
        for (int i = 0; i < viewed.size(); i++) {
            if (viewed.get(i) == o) return i;
        }
        return -1;
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        for (E e : c) {
            onAdded(e);
        }
        return viewed.addAll(index, c);
    }

    @Override
    public ListIterator<E> listIterator(int index) {
        ListIterator<E> li = viewed.listIterator(index);
        return new ListIterator<E>() {
            E last;

            @Override
            public boolean hasNext() {
                return li.hasNext();
            }

            @Override
            public E next() {
                return last = li.next();
            }

            @Override
            public boolean hasPrevious() {
                return li.hasPrevious();
            }

            @Override
            public E previous() {
                return last = li.previous();
            }

            @Override
            public int nextIndex() {
                return li.nextIndex();
            }

            @Override
            public int previousIndex() {
                return li.previousIndex();
            }

            @Override
            public void remove() {
                li.remove();
                onRemoved(last);
                last = null;
            }

            @Override
            public void set(E e) {
                onAdded(e);
                li.set(e);
                onRemoved(last);
                last = e;
            }

            @Override
            public void add(E e) {
                onAdded(e);
                li.add(e);
            }
        };
    }
}
