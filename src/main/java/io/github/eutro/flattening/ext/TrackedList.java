package io.github.eutro.flattening.ext;

import java.util.*;

/**
 * A list view which reports every element entering or leaving it,
 * used to keep owner exts up to date as IR is edited.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    protected TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

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
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        for (E e : viewed) {
            onRemoved(e);
        }
        viewed.clear();
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
                li.set(e);
                onRemoved(last);
                onAdded(e);
                last = e;
            }

            @Override
            public void add(E e) {
                onAdded(e);
                li.add(e);
            }
        };
    }

    @Override
    public Iterator<E> iterator() {
        return listIterator();
    }
}
